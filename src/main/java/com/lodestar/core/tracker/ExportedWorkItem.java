package com.lodestar.core.tracker;

public record ExportedWorkItem(String workItemId, String reference, String status) {}
