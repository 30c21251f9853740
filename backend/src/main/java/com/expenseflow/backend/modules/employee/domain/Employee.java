package com.expenseflow.backend.modules.employee.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

import com.expenseflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

@Entity
@Table(name = "employee")
public class Employee extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "position", nullable = false, length = 200)
    private String position;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "employee_cost_center", joinColumns = @JoinColumn(name = "employee_id"))
    @Column(name = "cost_center", nullable = false, length = 200)
    private Set<String> costCenters = new LinkedHashSet<>();

    @Column(name = "supervisor_id", length = 64)
    private String supervisorId;

    @Column(name = "archived", nullable = false)
    private boolean archived;

    @Column(name = "archived_at")
    private OffsetDateTime archivedAt;

    protected Employee() {
    }

    public Employee(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPosition() {
        return position;
    }

    public void setPosition(String position) {
        this.position = position;
    }

    public Set<String> getCostCenters() {
        return costCenters;
    }

    public void replaceCostCenters(Set<String> costCenters) {
        this.costCenters.clear();
        this.costCenters.addAll(costCenters);
    }

    public String getSupervisorId() {
        return supervisorId;
    }

    public void setSupervisorId(String supervisorId) {
        this.supervisorId = supervisorId;
    }

    public boolean isArchived() {
        return archived;
    }

    public OffsetDateTime getArchivedAt() {
        return archivedAt;
    }

    public void archive(OffsetDateTime now) {
        if (archived) {
            return;
        }
        this.archived = true;
        this.archivedAt = now;
    }

    public void restore() {
        this.archived = false;
        this.archivedAt = null;
    }
}
