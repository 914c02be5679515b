package com.phantom.domain.enums;

public enum DefaultCategory {
    EXAM("Exam", 5, "#FF0000", "Exams and tests"),
    STUDY("Study", 4, "#FFA500", "Study sessions"),
    GYM("Gym", 3, "#00FF00", "Gym and fitness activities"),
    SOCIAL("Social", 2, "#0000FF", "Social events and gatherings"),
    GAMING("Gaming", 1, "#800080", "Gaming and entertainment");

    private final String displayName;
    private final int priorityLevel;
    private final String color;
    private final String description;

    DefaultCategory(String displayName, int priorityLevel, String color, String description) {
        this.displayName = displayName;
        this.priorityLevel = priorityLevel;
        this.color = color;
        this.description = description;
    }

    public String displayName() {
        return displayName;
    }

    public int priorityLevel() {
        return priorityLevel;
    }

    public String color() {
        return color;
    }

    public String description() {
        return description;
    }
}
