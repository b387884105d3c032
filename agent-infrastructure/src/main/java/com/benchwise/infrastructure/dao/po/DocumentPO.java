package com.benchwise.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Document PO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentPO {

    private Long id;

    private Long matterId;

    private String filename;

    private String extractedText;

    private String fileType;

    private LocalDateTime createdAt;
}
