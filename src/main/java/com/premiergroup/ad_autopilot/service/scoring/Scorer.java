package com.premiergroup.ad_autopilot.service.scoring;

import com.premiergroup.ad_autopilot.dto.ScorerOutput;
import com.premiergroup.ad_autopilot.dto.ScoringBundle;

/**
 * Decision function of the control loop: metrics and context in, proposed
 * mutations out. An empty proposal means nothing needs to change.
 */
public interface Scorer {

    String name();

    ScorerOutput score(ScoringBundle bundle);
}
