package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Reusable block arrangement. Template blocks are not backed by statements,
 * so every block in {@link #getBlocks()} has an empty statement id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlockTemplate {

    private String id;
    private String name;
    private String description;
    private String category;
    private List<Block> blocks = new ArrayList<>();
    private boolean builtIn;
    private long createdAt;
    private long updatedAt;

    public BlockTemplate() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public void setBlocks(List<Block> blocks) {
        this.blocks = blocks != null ? blocks : new ArrayList<>();
    }

    public boolean isBuiltIn() {
        return builtIn;
    }

    public void setBuiltIn(boolean builtIn) {
        this.builtIn = builtIn;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "BlockTemplate{" + id + ", " + name + "}";
    }
}
