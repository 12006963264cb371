package com.example.excelops.service;

import java.util.List;

public record ValidationInfo(
        String range,
        String type,
        String operator,
        String formula1,
        String formula2,
        List<String> allowedValues,
        boolean allowBlank,
        String promptTitle,
        String promptText,
        String errorTitle,
        String errorText
) {
}
