package com.rigdef.cli.report;

import lombok.Value;

@Value
public class ElementCount {
    String label;
    int count;
}
