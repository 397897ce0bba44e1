package com.example.profile.model;

import java.time.Instant;

public record ScheduledDelivery(Instant scheduledAt) {}
