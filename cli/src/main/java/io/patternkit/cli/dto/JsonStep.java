package io.patternkit.cli.dto;

public class JsonStep {
    public String action;
    public String operator;
    public Long operand;
    public Integer levels;
}
