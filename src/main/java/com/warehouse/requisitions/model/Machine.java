package com.warehouse.requisitions.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "machines")
@Data
public class Machine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 50)
    private String code;

    @Column(nullable = false)
    private String name;

    // Optional: a machine may not be assigned to an area yet
    @ManyToOne
    @JoinColumn(name = "area_id")
    private Area area;
}
