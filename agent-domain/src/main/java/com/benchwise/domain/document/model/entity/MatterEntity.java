package com.benchwise.domain.document.model.entity;

import lombok.Data;

/**
 * Legal matter. Read-only to the agent core.
 *
 * @author benchwise
 * @since 2026-03-04
 */
@Data
public class MatterEntity {

    public static final String GENERAL_RESEARCH_NAME = "General Research";

    /**
     * Primary key
     */
    private Long id;

    /**
     * Matter name
     */
    private String name;

    /**
     * Description
     */
    private String description;

    /**
     * Client name
     */
    private String clientName;

    /**
     * Matter number
     */
    private String matterNumber;

    /**
     * Practice area
     */
    private String practiceArea;

    /**
     * Status
     */
    private String status;

    /**
     * Placeholder used for matter-less tasks.
     */
    public static MatterEntity generalResearch() {
        MatterEntity matter = new MatterEntity();
        matter.setName(GENERAL_RESEARCH_NAME);
        matter.setDescription("General legal research without a specific matter context");
        matter.setStatus("active");
        return matter;
    }
}
