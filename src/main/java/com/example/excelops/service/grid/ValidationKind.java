package com.example.excelops.service.grid;

public enum ValidationKind {
    ANY,
    WHOLE,
    DECIMAL,
    LIST,
    DATE,
    TIME,
    TEXT_LENGTH,
    CUSTOM
}
