package com.agrotrace.api.practice;

public record PracticeLogSettingsView(String owner, String moderator) {}
