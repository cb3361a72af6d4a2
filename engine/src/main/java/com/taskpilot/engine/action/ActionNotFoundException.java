package com.taskpilot.engine.action;

public class ActionNotFoundException extends RuntimeException {
    public ActionNotFoundException(String name) {
        super("No action registered with name: '" + name + "'");
    }
}
