package com.wagerdesk.common.data;

import com.wagerdesk.common.model.OpponentStrength;
import com.wagerdesk.common.model.OverUnderRecord;
import com.wagerdesk.common.model.VenueSplit;

/**
 * Secondary splits for one side; any component may be {@code null}.
 */
public record SideProfile(VenueSplit venue, OpponentStrength strength, OverUnderRecord overUnder) {}
