package com.benchwise.domain.review.model.valobj;

import com.benchwise.types.enums.PrivilegeTypeEnum;

import java.time.LocalDateTime;

/**
 * Privilege log row, one per withheld document.
 */
public record PrivilegeLogEntry(int logNumber,
                                Long documentId,
                                String filename,
                                LocalDateTime date,
                                String author,
                                String recipient,
                                PrivilegeTypeEnum privilegeType,
                                String privilegeBasis,
                                String description,
                                int confidenceScore) {
}
