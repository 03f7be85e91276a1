package com.hindsight.setforget.dto;

public record Substitution(long outId, long inId) {}
