package com.ruian.validation;

import com.ruian.entity.EmployeeWorklog;
import lombok.Value;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Natural key of a worklog row: (order_no, employee_id, job_type, work day).
 *
 * The schema does not enforce it, so two rows with the same key can be
 * stored; the later one is tagged as a duplicate.
 */
@Value
public class WorklogKey {

    String orderNo;
    String employeeId;
    String jobType;
    LocalDate workDay;

    /**
     * Build the key of a worklog, taking the calendar day of its work date
     * in the given business zone.
     */
    public static WorklogKey of(EmployeeWorklog worklog, ZoneId zone) {
        LocalDate workDay = worklog.getWorkDate() == null
                ? null
                : worklog.getWorkDate().atZoneSameInstant(zone).toLocalDate();
        return new WorklogKey(
                OrderJobKey.normalize(worklog.getOrderNo()),
                OrderJobKey.normalize(worklog.getEmployeeId()),
                OrderJobKey.normalize(worklog.getJobType()),
                workDay);
    }
}
