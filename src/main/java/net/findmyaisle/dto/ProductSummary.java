package net.findmyaisle.dto;

import java.util.List;

public record ProductSummary(String name, String brand, String size, List<String> images) {
}
