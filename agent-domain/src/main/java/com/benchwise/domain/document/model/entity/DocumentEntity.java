package com.benchwise.domain.document.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Matter document with its extracted text.
 *
 * @author benchwise
 * @since 2026-03-04
 */
@Data
public class DocumentEntity {

    /**
     * Primary key
     */
    private Long id;

    /**
     * Owning matter ID
     */
    private Long matterId;

    /**
     * Original file name
     */
    private String filename;

    /**
     * Extracted plain text
     */
    private String extractedText;

    /**
     * File type, e.g. pdf, docx, email
     */
    private String fileType;

    /**
     * Creation time
     */
    private LocalDateTime createdAt;

    public String lowerText() {
        return extractedText == null ? "" : extractedText.toLowerCase(Locale.ROOT);
    }

    public String lowerFilename() {
        return filename == null ? "" : filename.toLowerCase(Locale.ROOT);
    }
}
