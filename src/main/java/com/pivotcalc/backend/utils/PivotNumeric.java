package com.pivotcalc.backend.utils;

import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.text.ParsePosition;
import java.util.Locale;
import java.util.regex.Pattern;

import com.google.common.primitives.Doubles;

/**
 * 宽松的数值转换：
 * <ul>
 *     <li>{@link Number}：直接取 double，NaN / Infinity 视为非数值</li>
 *     <li>字符串：先按固定格式解析，再按区域格式解析，最后尝试百分号形式（除以 100）。
 *     固定格式只接受十进制与科学计数法，"5d"、"1f"、"0x1p3" 这类 Java 字面量写法不算数值</li>
 *     <li>其它类型（Boolean、Character 等）一律不是数值</li>
 * </ul>
 * 转换失败返回 null，由调用方决定跳过还是计数。
 */
public final class PivotNumeric {

    public static final PivotNumeric DEFAULT = new PivotNumeric(Locale.getDefault());

    private static final Pattern INVARIANT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Locale locale;
    private final String percentSymbol;

    public PivotNumeric(Locale locale) {
        this.locale = locale == null ? Locale.ROOT : locale;
        this.percentSymbol = String.valueOf(DecimalFormatSymbols.getInstance(this.locale).getPercent());
    }

    public Locale getLocale() {
        return locale;
    }

    /**
     * 尝试把任意值转换为有限的 double。
     *
     * @return 转换结果，无法转换时返回 null
     */
    public Double toDouble(Object value) {
        if(value == null) {
            return null;
        }
        if(value instanceof Number) {
            return finite(((Number) value).doubleValue());
        }
        if(value instanceof String) {
            return parse((String) value);
        }
        return null;
    }

    public boolean isNumber(Object value) {
        return toDouble(value) != null;
    }

    private Double parse(String raw) {
        String text = raw.trim();
        if(text.isEmpty()) {
            return null;
        }
        Double invariant = parseInvariant(text);
        if(invariant != null) {
            return finite(invariant);
        }
        Double localized = parseLocalized(text);
        if(localized != null) {
            return localized;
        }
        return parsePercent(text);
    }

    private static Double parseInvariant(String text) {
        if(!INVARIANT.matcher(text).matches()) {
            return null;
        }
        return Doubles.tryParse(text);
    }

    private Double parseLocalized(String text) {
        NumberFormat format = NumberFormat.getNumberInstance(locale);
        ParsePosition pos = new ParsePosition(0);
        Number number = format.parse(text, pos);
        // 必须整段消费，"12abc" 不算数值
        if(number == null || pos.getIndex() != text.length()) {
            return null;
        }
        return finite(number.doubleValue());
    }

    private Double parsePercent(String text) {
        String symbol = percentSymbol;
        if(!text.contains(symbol)) {
            if(!text.contains("%")) {
                return null;
            }
            symbol = "%";
        }
        String cleaned = text.replace(symbol, "").trim();
        if(cleaned.isEmpty()) {
            return null;
        }
        Double number = parseInvariant(cleaned);
        if(number == null) {
            number = parseLocalized(cleaned);
        }
        if(number == null) {
            return null;
        }
        return finite(number / 100d);
    }

    private static Double finite(double d) {
        if(Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        return d;
    }
}
