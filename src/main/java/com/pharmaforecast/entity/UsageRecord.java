package com.pharmaforecast.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
    name = "inventory",
    uniqueConstraints = @UniqueConstraint(name = "uq_inventory_drug_date", columnNames = {"drug_id", "date"}),
    indexes = {
        @Index(name = "idx_inventory_date",      columnList = "date"),
        @Index(name = "idx_inventory_drug_date", columnList = "drug_id, date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UsageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "drug_id", nullable = false)
    private Integer drugId;

    @Column(nullable = false)
    private LocalDate date;

    @Column(name = "quantity_used", nullable = false)
    private int quantityUsed;

    @Column(name = "opening_stock")
    private int openingStock;

    @Column(name = "closing_stock")
    private int closingStock;

    @Column(name = "quantity_received")
    private int quantityReceived;

    @Column(name = "stockout_flag")
    private boolean stockoutFlag;
}
