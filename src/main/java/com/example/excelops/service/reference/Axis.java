package com.example.excelops.service.reference;

public enum Axis {
    ROW,
    COLUMN;

    public int coordinate(CellAddress address) {
        return this == ROW ? address.row() : address.column();
    }

    public CellAddress withCoordinate(CellAddress address, int value) {
        return this == ROW
                ? new CellAddress(address.column(), value)
                : new CellAddress(value, address.row());
    }

    public int limit() {
        return this == ROW ? CellAddress.MAX_ROWS : CellAddress.MAX_COLUMNS;
    }

    public String label(int count) {
        String name = this == ROW ? "row" : "column";
        return count == 1 ? name : name + "s";
    }
}
