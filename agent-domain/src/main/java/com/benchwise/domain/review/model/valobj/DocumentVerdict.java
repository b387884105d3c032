package com.benchwise.domain.review.model.valobj;

import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.types.enums.VerdictProvenanceEnum;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Verdict of one classifier about one document.
 * <p>
 * Confidence is always held in [0, 100]. A verdict comes entirely from one path, recorded in
 * {@link #provenance}.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
public abstract class DocumentVerdict {

    /**
     * Subject document ID
     */
    private Long documentId;

    /**
     * Subject document file name
     */
    private String filename;

    /**
     * Subject document file type
     */
    private String fileType;

    /**
     * Subject document date
     */
    private LocalDateTime documentDate;

    /**
     * Confidence or score, 0-100
     */
    private int confidence;

    /**
     * Human readable reasons
     */
    private List<String> basis = new ArrayList<>();

    /**
     * Classifier path that produced this verdict
     */
    private VerdictProvenanceEnum provenance;

    /**
     * The classifier's boolean verdict
     */
    @JsonIgnore
    public abstract boolean isPositive();

    public void setConfidence(int confidence) {
        this.confidence = clamp(confidence);
    }

    public void setBasis(List<String> basis) {
        this.basis = basis == null ? new ArrayList<>() : new ArrayList<>(basis);
    }

    public void bindDocument(DocumentEntity document) {
        this.documentId = document.getId();
        this.filename = document.getFilename();
        this.fileType = document.getFileType();
        this.documentDate = document.getCreatedAt();
    }

    public static int clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return (int) Math.max(0, Math.min(100, Math.round(value)));
    }
}
