package com.pivotcalc.api.service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.pivotcalc.api.config.PivotCalcConfig;
import com.pivotcalc.api.entity.FormulaCheckResult;
import com.pivotcalc.api.entity.PivotEvalResult;
import com.pivotcalc.api.entity.enums.ResponseFormat;
import com.pivotcalc.api.entity.request.CellRef;
import com.pivotcalc.api.entity.request.FieldSpecRequest;
import com.pivotcalc.api.entity.request.FormulaCheckRequest;
import com.pivotcalc.api.entity.request.PivotEvalRequest;
import com.pivotcalc.api.entity.response.PivotEvalResponse;
import com.pivotcalc.backend.aggregator.AggregatorRegistry;
import com.pivotcalc.backend.cell.CellKey;
import com.pivotcalc.backend.formula.FieldLookup;
import com.pivotcalc.backend.formula.Formula;
import com.pivotcalc.backend.formula.FormulaException;
import com.pivotcalc.backend.server.PivotExecutor;
import com.pivotcalc.backend.utils.PivotNumeric;
import com.pivotcalc.common.ConsoleResultFormatter;
import com.pivotcalc.common.Error;
import com.pivotcalc.common.EvalResult;
import com.pivotcalc.common.PivotDefinition;
import com.pivotcalc.common.ResultFormatter;

@Service
public class PivotService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotService.class);

    private final PivotCalcConfig config;
    private final PivotNumeric numeric;
    private final ResultFormatter formatter = new ConsoleResultFormatter();

    public PivotService(PivotCalcConfig config) {
        this.config = config;
        this.numeric = new PivotNumeric(config.toLocale());
    }

    public PivotEvalResponse<?> evaluate(PivotEvalRequest request) {
        try {
            if(request.getRecords().size() > config.getMaxRecords()) {
                throw Error.TooManyRecordsException;
            }
            PivotDefinition definition = request.toDefinition();
            PivotExecutor executor = PivotExecutor.of(definition, new AggregatorRegistry(numeric), "rest");
            if(executor.getCells().size() > config.getMaxCells()) {
                throw Error.TooManyCellsException;
            }
            EvalResult result;
            if(request.getCells() == null || request.getCells().isEmpty()) {
                result = executor.evaluateAll();
            } else {
                List<CellKey> keys = new ArrayList<>();
                for (CellRef ref : request.getCells()) {
                    keys.add(CellKey.of(nullToEmpty(ref.getRow()), nullToEmpty(ref.getColumn())));
                }
                result = executor.evaluateCells(keys);
            }
            // 返回文本化结果
            if(request.getFormat() == ResponseFormat.TEXT) {
                String text = new String(formatter.format(result), StandardCharsets.UTF_8);
                return PivotEvalResponse.success(text);
            }
            return PivotEvalResponse.success(PivotEvalResult.from(result));
        } catch (Exception ex) {
            LOGGER.error("透视求值失败: {} fields, {} records", request.getFields().size(),
                    request.getRecords() == null ? 0 : request.getRecords().size(), ex);
            return PivotEvalResponse.failure(ex.getMessage());
        }
    }

    /**
     * 检查公式能否在给定字段上编译；编译失败不视为请求失败。
     */
    public PivotEvalResponse<?> checkFormula(FormulaCheckRequest request) {
        try {
            List<PivotDefinition.FieldSpec> specs = new ArrayList<>();
            for (FieldSpecRequest field : request.getFields()) {
                specs.add(field.toSpec());
            }
            FieldLookup lookup = FieldLookup.of(PivotExecutor.toValueFields(specs));
            try {
                return PivotEvalResponse.success(FormulaCheckResult.valid(Formula.compile(request.getFormula(), lookup)));
            } catch (FormulaException e) {
                LOGGER.debug("Formula rejected: {}", e.getMessage());
                return PivotEvalResponse.success(FormulaCheckResult.invalid(e));
            }
        } catch (Exception ex) {
            LOGGER.error("公式检查失败: {}", request.getFormula(), ex);
            return PivotEvalResponse.failure(ex.getMessage());
        }
    }

    private static List<Object> nullToEmpty(List<Object> path) {
        return path == null ? CellKey.EMPTY_PATH : path;
    }
}
