package com.agrotrace.api.practice;

import java.util.List;

/**
 * All entries of one farmer with their count.
 */
public record FarmerLogView(String farmer, long count, List<PracticeLogEntryView> entries) {}
