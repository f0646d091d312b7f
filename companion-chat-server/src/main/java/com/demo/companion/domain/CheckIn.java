package com.demo.companion.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only view of a daily mood check-in. Steps are kept as the raw JSON
 * written by the check-in collaborator and parsed when context is assembled.
 */
@Entity
@Table(name = "check_ins", indexes = {
    @Index(name = "idx_check_ins_user_date", columnList = "userId,date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckIn {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String userId;

    @Column(nullable = false)
    private Instant date;

    @Column(nullable = false)
    private double overallMood;

    @Column(nullable = false)
    private boolean completed;

    @Column(name = "steps", columnDefinition = "TEXT")
    private String stepsJson;
}
