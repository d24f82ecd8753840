package dev.labelflow.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.util.UUID;

/** Label class offered to annotators of a project. */
@Embeddable
public class ProjectClass {

    @Column(name = "class_id", nullable = false, length = 64)
    private String classId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 20)
    private String color;

    @Column(nullable = false)
    private boolean custom;

    protected ProjectClass() {
    }

    public static ProjectClass of(String name, String color) {
        ProjectClass c = new ProjectClass();
        c.classId = UUID.randomUUID().toString();
        c.name = name;
        c.color = color;
        c.custom = false;
        return c;
    }

    public String getClassId() {
        return classId;
    }

    public String getName() {
        return name;
    }

    public String getColor() {
        return color;
    }

    public boolean isCustom() {
        return custom;
    }
}
