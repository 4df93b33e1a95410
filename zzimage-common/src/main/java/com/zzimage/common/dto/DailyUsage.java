package com.zzimage.common.dto;

import lombok.Value;

import java.time.LocalDate;

/**
 * 某凭证在某一天的成功使用次数。
 */
@Value
public class DailyUsage {

    int count;
    LocalDate date;

    public static DailyUsage zero(LocalDate date) {
        return new DailyUsage(0, date);
    }
}
