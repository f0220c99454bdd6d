package com.stockalert.monitor.domain.settings;

public record OwnerSettings(Long ownerId, RefreshIntervals intervals) {}
