package com.demo.companion.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommittedTurn {
    private String userMessageId;
    private String assistantMessageId;
    private Instant committedAt;
}
