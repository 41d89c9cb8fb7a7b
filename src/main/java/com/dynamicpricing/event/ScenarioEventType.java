package com.dynamicpricing.event;

public enum ScenarioEventType {
    APPLIED,
    REPLACED,
    EXPIRED,
    CLEARED
}
