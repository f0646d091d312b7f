package com.demo.companion.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of the onboarding profile. Having one is a precondition of
 * chatting.
 */
@Entity
@Table(name = "profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Profile {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, unique = true, length = 100)
    private String userId;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Builder.Default
    private List<String> struggles = new ArrayList<>();

    private Instant struggleTimestamp;

    @Column(columnDefinition = "TEXT")
    private String struggleNotes;

    @Column(nullable = false)
    private boolean inTherapy;

    @Column(columnDefinition = "TEXT")
    private String therapyDetails;
}
