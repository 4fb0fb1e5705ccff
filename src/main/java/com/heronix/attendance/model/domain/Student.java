package com.heronix.attendance.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Student profile as read by the attendance core.
 *
 * Students are addressed by their USN (university serial number) on the
 * wire and by the surrogate id in storage.
 */
@Entity
@Table(name = "students", indexes = {
    @Index(name = "idx_student_usn", columnList = "usn", unique = true),
    @Index(name = "idx_student_department", columnList = "department")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * University serial number (e.g., "1CS21001").
     */
    @Column(name = "usn", nullable = false, unique = true, length = 20)
    private String usn;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "department", nullable = false, length = 50)
    private String department;

    /**
     * JSON array of face embeddings registered for the student.
     * The first embedding is sent to the recognition service.
     */
    @Lob
    @Column(name = "face_embeddings")
    private String faceEmbeddings;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
