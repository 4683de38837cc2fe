package com.example.mesh.web.rest.dto;

public record DataItem(int id, String name, String description) {}
