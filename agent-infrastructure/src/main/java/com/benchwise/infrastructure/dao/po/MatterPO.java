package com.benchwise.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Matter PO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatterPO {

    private Long id;

    private String name;

    private String description;

    private String clientName;

    private String matterNumber;

    private String practiceArea;

    private String status;
}
