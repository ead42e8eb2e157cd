package com.pivotcalc.api.entity.request;

import javax.validation.constraints.NotBlank;

import com.pivotcalc.common.PivotDefinition;

public class FieldSpecRequest {

    @NotBlank(message = "字段 key 不能为空")
    private String key;

    private String header;

    /**
     * 聚合类型名，默认 sum
     */
    private String aggregate;

    private String formula;

    /**
     * 展示方式名，默认 value
     */
    private String displayMode;

    public PivotDefinition.FieldSpec toSpec() {
        PivotDefinition.FieldSpec spec = new PivotDefinition.FieldSpec(key, aggregate, formula);
        spec.setHeader(header);
        spec.setDisplayMode(displayMode);
        return spec;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getHeader() {
        return header;
    }

    public void setHeader(String header) {
        this.header = header;
    }

    public String getAggregate() {
        return aggregate;
    }

    public void setAggregate(String aggregate) {
        this.aggregate = aggregate;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public String getDisplayMode() {
        return displayMode;
    }

    public void setDisplayMode(String displayMode) {
        this.displayMode = displayMode;
    }
}
