package com.pivotcalc.api.entity.request;

import java.util.ArrayList;
import java.util.List;

/**
 * 单元格坐标，空路径表示该方向上的总计。
 */
public class CellRef {

    private List<Object> row = new ArrayList<>();
    private List<Object> column = new ArrayList<>();

    public List<Object> getRow() {
        return row;
    }

    public void setRow(List<Object> row) {
        this.row = row;
    }

    public List<Object> getColumn() {
        return column;
    }

    public void setColumn(List<Object> column) {
        this.column = column;
    }
}
