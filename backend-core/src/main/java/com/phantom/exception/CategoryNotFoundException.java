package com.phantom.exception;

public class CategoryNotFoundException extends SchedulingException {

    private final String categoryName;

    public CategoryNotFoundException(String categoryName) {
        super("Category not found: " + categoryName);
        this.categoryName = categoryName;
    }

    public String getCategoryName() {
        return categoryName;
    }
}
