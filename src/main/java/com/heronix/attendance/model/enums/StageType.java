package com.heronix.attendance.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The four inference stages run for every student after a submission.
 *
 * Stage numbers follow the analytics models: trend (1) and consistency (3)
 * are independent, attentiveness (4) consumes consistency, risk (2) consumes
 * all three.
 */
@Getter
@RequiredArgsConstructor
public enum StageType {

    TREND(1, "trend"),

    CONSISTENCY(3, "consistency"),

    ATTENTIVENESS(4, "attentiveness"),

    RISK(2, "risk");

    /**
     * Model number of the stage
     */
    private final int stageNumber;

    /**
     * Name of the single output field the stage returns
     */
    private final String outputField;
}
