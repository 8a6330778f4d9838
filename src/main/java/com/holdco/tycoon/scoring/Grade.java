package com.holdco.tycoon.scoring;

/**
 * Letter grade for a finished game, with the minimum total that earns it.
 */
public enum Grade {
    S(90, "Master Allocator - You'd make Buffett proud"),
    A(75, "Skilled Compounder - Constellation-level discipline"),
    B(60, "Solid Builder - Your holdco has real potential"),
    C(40, "Emerging Operator - Room to sharpen your allocation instincts"),
    D(20, "Apprentice - Study the playbook and try again"),
    F(0, "Blown Up - Tyco sends its regards");

    private final int minTotal;
    private final String title;

    Grade(int minTotal, String title) {
        this.minTotal = minTotal;
        this.title = title;
    }

    public int getMinTotal() {
        return minTotal;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Highest grade whose threshold the total reaches.
     */
    public static Grade forTotal(int total) {
        for (Grade grade : values()) {
            if (total >= grade.minTotal) {
                return grade;
            }
        }
        return F;
    }
}
