package work.lcod.choiceimport.model;

public record TargetOption(String name, String guid) {}
