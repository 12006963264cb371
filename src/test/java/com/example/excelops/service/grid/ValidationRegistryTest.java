package com.example.excelops.service.grid;

import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationRegistryTest {

    private static ValidationRule listRule(String range, String... values) {
        return new ValidationRule(CellRange.parse(range), ValidationKind.LIST, ValidationCriteria.list(List.of(values)));
    }

    @Test
    void rulesMayOverlapAndLastCoveringRuleApplies() {
        ValidationRegistry rules = new ValidationRegistry();
        rules.add(listRule("A1:A10", "a", "b"));
        rules.add(listRule("A5:B6", "x"));

        assertEquals(2, rules.listForSheet().size());
        assertEquals(List.of("x"),
                rules.applicableTo(CellAddress.parse("A5")).orElseThrow().criteria().explicitValues());
        assertEquals(List.of("a", "b"),
                rules.applicableTo(CellAddress.parse("A1")).orElseThrow().criteria().explicitValues());
        assertTrue(rules.applicableTo(CellAddress.parse("C1")).isEmpty());
    }

    @Test
    void singleCellRulesSurviveShifting() {
        ValidationRegistry rules = new ValidationRegistry();
        rules.add(listRule("B2:B3", "yes", "no"));

        int dropped = rules.shiftAll(Axis.ROW, 3, -1);

        assertEquals(0, dropped);
        assertEquals("B2", rules.list().get(0).range().encode());
    }

    @Test
    void shiftsIdenticallyToMerges() {
        ValidationRegistry rules = new ValidationRegistry();
        MergeRegistry merges = new MergeRegistry();
        rules.add(listRule("C3:D6", "v"));
        merges.register(CellRange.parse("C3:D6"));

        rules.shiftAll(Axis.COLUMN, 4, 3);
        merges.shiftAll(Axis.COLUMN, 4, 3);

        assertEquals("C3:G6", rules.list().get(0).range().encode());
        assertEquals(merges.list().get(0).range(), rules.list().get(0).range());
    }
}
