package com.spreadtracker.common.model;

/**
 * Quote currencies handled by the tracker. International venues quote in USD,
 * South African venues in ZAR.
 */
public enum Currency {
    USD,
    ZAR
}
