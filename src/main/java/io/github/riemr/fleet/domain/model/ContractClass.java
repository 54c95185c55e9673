package io.github.riemr.fleet.domain.model;

import java.util.Locale;

/**
 * 契約区分。区分ごとに HOS（乗務時間）のローリング窓と上限時間が決まる。
 */
public enum ContractClass {
    CLASS_A("classA", 24, 14.0),
    CLASS_B("classB", 48, 38.0);

    private final String code;
    private final int lookbackHours;
    private final double limitHours;

    ContractClass(String code, int lookbackHours, double limitHours) {
        this.code = code;
        this.lookbackHours = lookbackHours;
        this.limitHours = limitHours;
    }

    public String getCode() { return code; }
    public int getLookbackHours() { return lookbackHours; }
    public double getLimitHours() { return limitHours; }

    /**
     * 外部表記（"classA", "Solo 1", "solo2" など）を区分へ正規化する。
     * 小文字化し空白を除去した上で照合する。
     *
     * @throws IllegalArgumentException 未対応の表記
     */
    public static ContractClass parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Contract class is required");
        String s = normalize(raw);
        switch (s) {
            case "classa":
            case "solo1":
            case "a":
                return CLASS_A;
            case "classb":
            case "solo2":
            case "b":
                return CLASS_B;
            default:
                throw new IllegalArgumentException("Unsupported contract class: " + raw);
        }
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
    }

    @Override
    public String toString() { return code; }
}
