package com.pivotcalc.api.entity.request;

import java.util.ArrayList;
import java.util.List;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;

import com.pivotcalc.api.entity.enums.ResponseFormat;
import com.pivotcalc.common.PivotDefinition;

public class PivotEvalRequest {

    @NotEmpty(message = "fields 不能为空")
    @Valid
    private List<FieldSpecRequest> fields;

    @NotNull(message = "records 不能为空")
    private List<PivotDefinition.RecordSpec> records;

    /**
     * 需要求值的单元格，为空时求全部单元格
     */
    private List<CellRef> cells;

    /**
     * 返回格式：TEXT 或 STRUCTURED（默认）
     */
    private ResponseFormat format;

    public PivotDefinition toDefinition() {
        PivotDefinition definition = new PivotDefinition();
        List<PivotDefinition.FieldSpec> specs = new ArrayList<>();
        for (FieldSpecRequest field : fields) {
            specs.add(field.toSpec());
        }
        definition.setFields(specs);
        definition.setRecords(records);
        return definition;
    }

    public List<FieldSpecRequest> getFields() {
        return fields;
    }

    public void setFields(List<FieldSpecRequest> fields) {
        this.fields = fields;
    }

    public List<PivotDefinition.RecordSpec> getRecords() {
        return records;
    }

    public void setRecords(List<PivotDefinition.RecordSpec> records) {
        this.records = records;
    }

    public List<CellRef> getCells() {
        return cells;
    }

    public void setCells(List<CellRef> cells) {
        this.cells = cells;
    }

    public ResponseFormat getFormat() {
        return format;
    }

    public void setFormat(ResponseFormat format) {
        this.format = format;
    }
}
