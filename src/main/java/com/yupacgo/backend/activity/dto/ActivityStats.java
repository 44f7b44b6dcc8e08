package com.yupacgo.backend.activity.dto;

import java.util.List;

public record ActivityStats(List<ActionCount> byAction, long todayTotal, int periodDays) {}
