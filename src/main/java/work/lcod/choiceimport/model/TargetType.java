package work.lcod.choiceimport.model;

/**
 * Closed set of catalog slot types the engine can fill.
 */
public enum TargetType {
    FEATURE_CHOICE("CharacterFeatureChoice"),
    LANGUAGE_CHOICE("CharacterLanguageChoice"),
    FEAT_CHOICE("CharacterFeatChoice"),
    SKILL_CHOICE("CharacterSkillChoice"),
    DEITY_CHOICE("CharacterDeityChoice"),
    SUBCLASS_CHOICE("CharacterSubclassChoice"),
    DEITY_DOMAIN_CHOICE("CharacterDeityDomainChoice"),
    OTHER("");

    private final String typeName;

    TargetType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static TargetType fromTypeName(String typeName) {
        if (typeName == null) {
            return OTHER;
        }
        for (TargetType type : values()) {
            if (type != OTHER && type.typeName.equals(typeName)) {
                return type;
            }
        }
        return OTHER;
    }
}
