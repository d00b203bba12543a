package com.jay.trendagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "equity_curve")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquityPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String configId;
    private Instant pointTime;
    private double equity;
}
