package com.example.excelops.service;

import com.example.excelops.service.engine.CopyRangeEngine;
import com.example.excelops.service.engine.StructuralMutator;
import com.example.excelops.service.formula.FormulaReferenceRewriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExcelOpsConfig {

    @Bean
    public ExcelOpsProperties excelOpsProperties(
            @Value("${excel.ops.files-path:}") String filesPath,
            @Value("${excel.ops.shift-absolute-references:true}") boolean shiftAbsoluteReferences,
            @Value("${excel.ops.read-preview-limit:500}") int readPreviewLimit) {
        return new ExcelOpsProperties(filesPath, shiftAbsoluteReferences, readPreviewLimit);
    }

    @Bean
    public FormulaReferenceRewriter formulaReferenceRewriter(ExcelOpsProperties properties) {
        return new FormulaReferenceRewriter(properties.shiftAbsoluteReferences());
    }

    @Bean
    public StructuralMutator structuralMutator(FormulaReferenceRewriter rewriter) {
        return new StructuralMutator(rewriter);
    }

    @Bean
    public CopyRangeEngine copyRangeEngine(FormulaReferenceRewriter rewriter) {
        return new CopyRangeEngine(rewriter);
    }
}
