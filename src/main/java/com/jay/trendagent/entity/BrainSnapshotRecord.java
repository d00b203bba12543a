package com.jay.trendagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "brain_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrainSnapshotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String configId;
    private Instant createdAt;
    private String mode;
    @Column(length = 4000)
    private String payload;        // JSON
}
