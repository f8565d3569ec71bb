package com.audience.segments.model;

import java.util.UUID;

public record TriggerResponse(Long ruleId, UUID jobId) {}
