package com.ruian.validation;

import lombok.Value;

/**
 * (order_no, job_type) pair used to link worklogs to production rows.
 */
@Value
public class OrderJobKey {

    String orderNo;
    String jobType;

    public static OrderJobKey of(String orderNo, String jobType) {
        return new OrderJobKey(normalize(orderNo), normalize(jobType));
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
