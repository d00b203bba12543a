package com.jay.trendagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "symbol_overrides")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolOverride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String configId;
    private String symbol;
    private boolean blocked;
    private Instant blockUntil;    // null = blocked until cleared by hand
    @Column(length = 300)
    private String note;
    private Instant createdAt;
}
