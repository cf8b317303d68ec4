package com.budgetpilot.categorization.suggestion;

/**
 * Optional edits applied when approving. All fields nullable; {@code categoryId} wins over the name/icon/color edits.
 */
public record ApproveOverrides(String categoryId,
                               String categoryName,
                               String categoryIcon,
                               String categoryColor,
                               String matchType,
                               String keyword) {

    public static ApproveOverrides none() {
        return new ApproveOverrides(null, null, null, null, null, null);
    }

    boolean editsCategory() {
        return notBlank(categoryName) || notBlank(categoryIcon) || notBlank(categoryColor);
    }

    static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
