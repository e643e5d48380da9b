package com.community.portal.aggregation;

/**
 * 可按需计算的比率指标，结果为百分比（保留 1 位小数）
 */
public enum RatioMetric {

    // 已激活门户账号业主 / 符合条件业主总数
    ACTIVE_PORTAL_RATE,

    // 有门户账号记录的业主（无论是否激活）/ 符合条件业主总数
    REGISTERED_RATE,

    // 无门户账号业主 / 符合条件业主总数
    WITHOUT_PORTAL_RATE,

    // 已激活 / 有门户账号记录的业主
    ACTIVATION_RATE;

    double compute(int total, int withActive, int withInactive, int without) {
        switch (this) {
            case ACTIVE_PORTAL_RATE:
                return percentage(withActive, total);
            case REGISTERED_RATE:
                return percentage(withActive + withInactive, total);
            case WITHOUT_PORTAL_RATE:
                return percentage(without, total);
            case ACTIVATION_RATE:
                return percentage(withActive, withActive + withInactive);
            default:
                throw new IllegalStateException("未知指标: " + this);
        }
    }

    private static double percentage(int numerator, int denominator) {
        // 分母为 0（没有符合条件的业主）时返回 0，而不是报错
        if (denominator <= 0) {
            return 0.0;
        }
        double percentage = (double) numerator / denominator * 100.0;
        return Math.round(percentage * 10.0) / 10.0;
    }
}
