package com.example.excelops.service;

import java.util.List;

public record ValidationListing(String sheetName, List<ValidationInfo> validations, String message) {
}
