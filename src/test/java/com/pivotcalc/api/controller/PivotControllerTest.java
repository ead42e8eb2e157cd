package com.pivotcalc.api.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class PivotControllerTest {

    private static final String FIELDS = "\"fields\":["
            + "{\"key\":\"Revenue\",\"aggregate\":\"sum\"},"
            + "{\"key\":\"Cost\",\"aggregate\":\"sum\"},"
            + "{\"key\":\"Profit\",\"formula\":\"Revenue - Cost\"}]";

    private static final String RECORDS = "\"records\":["
            + "{\"row\":[\"East\",\"NY\"],\"column\":[\"Q1\"],\"values\":[100,30]},"
            + "{\"row\":[\"East\",\"MA\"],\"column\":[\"Q1\"],\"values\":[\"80\",20]},"
            + "{\"row\":[\"West\",\"CA\"],\"column\":[\"Q2\"],\"values\":[200,90]}]";

    @Autowired
    private MockMvc mockMvc;

    @Test
    public void testEvaluateRequestedCells() throws Exception {
        String body = "{" + FIELDS + "," + RECORDS + ",\"cells\":["
                + "{\"row\":[\"East\",\"NY\"],\"column\":[\"Q1\"]},"
                + "{\"row\":[],\"column\":[]}]}";
        mockMvc.perform(post("/api/pivot/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.headers[4]").value("Profit"))
                .andExpect(jsonPath("$.data.resultRows").value(2))
                .andExpect(jsonPath("$.data.rows[0][0]").value("East / NY"))
                .andExpect(jsonPath("$.data.rows[0][4]").value("70"))
                .andExpect(jsonPath("$.data.rows[1][2]").value("380"))
                .andExpect(jsonPath("$.data.rows[1][4]").value("240"));
    }

    @Test
    public void testEvaluateAllAsText() throws Exception {
        String body = "{" + FIELDS + "," + RECORDS + ",\"format\":\"TEXT\"}";
        mockMvc.perform(post("/api/pivot/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").value(containsString("| East / NY")))
                .andExpect(jsonPath("$.data").value(containsString("cells in set")));
    }

    @Test
    public void testEvaluateFailures() throws Exception {
        String missingCell = "{" + FIELDS + "," + RECORDS + ",\"cells\":[{\"row\":[\"Nowhere\"],\"column\":[]}]}";
        mockMvc.perform(post("/api/pivot/evaluate").contentType(MediaType.APPLICATION_JSON).content(missingCell))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Pivot path not found"));

        StringBuilder records = new StringBuilder("\"records\":[");
        for (int i = 0; i < 11; i++) {
            if (i > 0) {
                records.append(',');
            }
            records.append("{\"row\":[\"r").append(i).append("\"],\"column\":[],\"values\":[1,1]}");
        }
        records.append(']');
        mockMvc.perform(post("/api/pivot/evaluate").contentType(MediaType.APPLICATION_JSON)
                        .content("{" + FIELDS + "," + records + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Too many records in pivot definition"));
    }

    @Test
    public void testEvaluateValidation() throws Exception {
        mockMvc.perform(post("/api/pivot/evaluate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\":[]," + RECORDS + "}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/pivot/evaluate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\":[{\"aggregate\":\"sum\"}]," + RECORDS + "}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testCheckFormula() throws Exception {
        mockMvc.perform(post("/api/pivot/formulas/check").contentType(MediaType.APPLICATION_JSON)
                        .content("{" + FIELDS + ",\"formula\":\"(Revenue - Cost) / GrandTotal(Revenue)\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.program").value("$0 $1 - GRAND_TOTAL($0) /"))
                .andExpect(jsonPath("$.data.usesGrandTotals").value(true))
                .andExpect(jsonPath("$.data.usesRowTotals").value(false));

        mockMvc.perform(post("/api/pivot/formulas/check").contentType(MediaType.APPLICATION_JSON)
                        .content("{" + FIELDS + ",\"formula\":\"Revenue # 2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(false))
                .andExpect(jsonPath("$.data.position").value(8))
                .andExpect(jsonPath("$.data.marked").value("Revenue << # 2"));

        mockMvc.perform(post("/api/pivot/formulas/check").contentType(MediaType.APPLICATION_JSON)
                        .content("{" + FIELDS + ",\"formula\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testLimitsAreConfigured() throws Exception {
        mockMvc.perform(post("/api/pivot/evaluate").contentType(MediaType.APPLICATION_JSON)
                        .content("{" + FIELDS + ",\"records\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rows", hasSize(1)));
    }
}
