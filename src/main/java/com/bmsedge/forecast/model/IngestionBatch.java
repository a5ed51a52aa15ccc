package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Audit row written once per committed sales upload.
 */
@Getter
@Setter
@Entity
@Table(name = "ingestion_batches")
public class IngestionBatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "file_name", length = 255)
    private String fileName;

    @Enumerated(EnumType.STRING)
    @Column(name = "layout", length = 10)
    private ExportLayout layout;

    @Column(name = "accepted_rows")
    private Integer acceptedRows = 0;

    @Column(name = "rejected_rows")
    private Integer rejectedRows = 0;

    @Column(name = "records_written")
    private Integer recordsWritten = 0;

    @Column(name = "min_date")
    private LocalDate minDate;

    @Column(name = "max_date")
    private LocalDate maxDate;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
