package com.starkiller.core.session;

import com.starkiller.core.consequence.ConsequenceToken;
import com.starkiller.core.consequence.NewsEntry;
import com.starkiller.core.model.DayRule;

import java.util.List;

/**
 * What happened when a new day began.
 *
 * @param day       the new day
 * @param newRules  briefing rules that came into force today
 * @param triggered consequences delivered this morning
 * @param news      news published this morning
 */
public record DayStart(int day, List<DayRule> newRules, List<ConsequenceToken> triggered, List<NewsEntry> news) {}
