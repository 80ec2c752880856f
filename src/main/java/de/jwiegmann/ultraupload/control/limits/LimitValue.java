package de.jwiegmann.ultraupload.control.limits;

import lombok.Value;

@Value
public class LimitValue {
    long value;
    String formatted;
    LimitSource bindingSource;
}
