package com.benchwise.domain.review.model.valobj;

import com.benchwise.types.enums.PrivilegeTypeEnum;
import com.benchwise.types.enums.RiskLevelEnum;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Privilege verdict.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class PrivilegeVerdict extends DocumentVerdict {

    private boolean privileged;

    private PrivilegeTypeEnum privilegeType = PrivilegeTypeEnum.NONE;

    /**
     * Whether an external disclosure may have waived privilege
     */
    private boolean potentialWaiver;

    private RiskLevelEnum waiverRisk = RiskLevelEnum.LOW;

    private String waiverReason;

    /**
     * Free-text analysis, model path only
     */
    private String analysis;

    private List<String> recommendations = new ArrayList<>();

    @Override
    public boolean isPositive() {
        return privileged;
    }
}
