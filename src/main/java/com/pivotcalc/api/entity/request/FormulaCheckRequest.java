package com.pivotcalc.api.entity.request;

import java.util.List;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;

public class FormulaCheckRequest {

    @NotEmpty(message = "fields 不能为空")
    @Valid
    private List<FieldSpecRequest> fields;

    @NotBlank(message = "formula 不能为空")
    private String formula;

    public List<FieldSpecRequest> getFields() {
        return fields;
    }

    public void setFields(List<FieldSpecRequest> fields) {
        this.fields = fields;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }
}
