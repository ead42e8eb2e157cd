package com.pivotcalc.api.controller;

import javax.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.pivotcalc.api.entity.request.FormulaCheckRequest;
import com.pivotcalc.api.entity.request.PivotEvalRequest;
import com.pivotcalc.api.entity.response.PivotEvalResponse;
import com.pivotcalc.api.service.PivotService;

@RestController
@RequestMapping("/api/pivot")
@Validated
public class PivotController {

    private final PivotService pivotService;

    public PivotController(PivotService pivotService) {
        this.pivotService = pivotService;
    }

    @PostMapping("/evaluate")
    public ResponseEntity<PivotEvalResponse<?>> evaluate(@Valid @RequestBody PivotEvalRequest request) {
        return ResponseEntity.ok(pivotService.evaluate(request));
    }

    @PostMapping("/formulas/check")
    public ResponseEntity<PivotEvalResponse<?>> checkFormula(@Valid @RequestBody FormulaCheckRequest request) {
        return ResponseEntity.ok(pivotService.checkFormula(request));
    }
}
