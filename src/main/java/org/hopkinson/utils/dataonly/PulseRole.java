package org.hopkinson.utils.dataonly;

/**
 * Три упругие волны, которые записывают датчики на стержнях.
 */
public enum PulseRole {
    INCIDENT,      // падающая
    TRANSMITTED,   // прошедшая через образец
    REFLECTED      // отражённая от образца
}
