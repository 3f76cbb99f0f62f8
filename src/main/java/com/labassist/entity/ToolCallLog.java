package com.labassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "tool_call_log", indexes = {
        @Index(name = "idx_tool_call_log_request", columnList = "request_id, call_order")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToolCallLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "request_id", nullable = false)
    private LabRequest request;

    @Column(name = "call_order", nullable = false)
    private int sequence;

    @Column(name = "tool_name", length = 120, nullable = false)
    private String toolName;

    @Column(name = "tool_input", columnDefinition = "TEXT")
    private String toolInput;

    @Column(name = "tool_output", columnDefinition = "TEXT")
    private String toolOutput;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "called_at", nullable = false)
    private OffsetDateTime calledAt;
}
