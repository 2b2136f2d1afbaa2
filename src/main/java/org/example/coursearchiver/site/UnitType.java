package org.example.coursearchiver.site;

public enum UnitType {
    VIDEO,
    LECTURE,
    QUIZ
}
