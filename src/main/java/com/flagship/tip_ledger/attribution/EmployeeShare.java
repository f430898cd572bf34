package com.flagship.tip_ledger.attribution;

import lombok.Value;

import java.util.UUID;

@Value
public class EmployeeShare {
    UUID employeeId;
    long shareCents;
}
