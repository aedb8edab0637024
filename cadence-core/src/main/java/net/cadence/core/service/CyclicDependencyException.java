package net.cadence.core.service;

public class CyclicDependencyException extends DefinitionException {
    public CyclicDependencyException(String field, String message) {
        super(field, message);
    }
}
