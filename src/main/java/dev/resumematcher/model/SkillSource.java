package dev.resumematcher.model;

public enum SkillSource {
    REQUIRED,
    EXTRACTED
}
