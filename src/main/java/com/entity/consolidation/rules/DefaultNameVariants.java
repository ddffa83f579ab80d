package com.entity.consolidation.rules;

import java.util.List;

/**
 * Built-in lookup tables for {@link NameVariants}.
 */
public final class DefaultNameVariants {

    private DefaultNameVariants() {
        // Utility class
    }

    /**
     * Creates the default tables.
     */
    public static NameVariants create() {
        NameVariants.Builder builder = NameVariants.builder()
                .stopWords(getStopWords())
                .titlePrefixes(getTitlePrefixes());
        addNicknames(builder);
        return builder.build();
    }

    /**
     * Leading words that mark an extraction artifact ("With Epstein", "When Maxwell").
     */
    public static List<String> getStopWords() {
        return List.of("with", "when", "what", "where", "that", "this",
                "from", "into", "over", "under", "after", "before");
    }

    /**
     * Honorifics and titles that may precede a full name.
     */
    public static List<String> getTitlePrefixes() {
        return List.of(
                "mr", "mrs", "ms", "dr", "prof", "hon", "sir", "madam", "lord", "lady",
                "prince", "princess", "president", "senator", "governor", "secretary",
                "judge", "attorney", "agent", "officer", "detective", "colonel", "general",
                "major", "captain", "lieutenant", "sgt", "sergeant", "rev", "reverend",
                "rep", "representative", "congressman", "congresswoman",
                "sheikh", "sheik", "king", "queen", "baron", "baroness", "count", "countess",
                "duke", "duchess", "emir", "sultan", "prime minister", "minister", "ambassador",
                "chancellor", "premier", "father", "sister", "brother", "rabbi", "imam",
                "bishop", "cardinal", "pope", "his highness", "her highness", "his majesty",
                "her majesty", "crown prince", "deputy"
        );
    }

    private static void addNicknames(NameVariants.Builder b) {
        b.nicknames("william", List.of("bill", "billy", "will", "willy"));
        b.nicknames("robert", List.of("bob", "bobby", "rob", "robby"));
        b.nicknames("james", List.of("jim", "jimmy", "jamie"));
        b.nicknames("john", List.of("jack", "jackie", "johnny"));
        b.nicknames("thomas", List.of("tom", "tommy"));
        b.nicknames("richard", List.of("dick", "rich", "rick", "ricky"));
        b.nicknames("elizabeth", List.of("liz", "lizzie", "beth", "betty"));
        b.nicknames("jeffrey", List.of("jeff"));
        b.nicknames("geoffrey", List.of("geoff"));
        b.nicknames("michael", List.of("mike", "mikey"));
        b.nicknames("david", List.of("dave"));
        b.nicknames("daniel", List.of("dan", "danny"));
        b.nicknames("christopher", List.of("chris"));
        b.nicknames("matthew", List.of("matt"));
        b.nicknames("andrew", List.of("andy"));
        b.nicknames("joseph", List.of("joe", "joey"));
        b.nicknames("charles", List.of("charlie", "chuck"));
        b.nicknames("anthony", List.of("tony"));
        b.nicknames("donald", List.of("don", "donny"));
        b.nicknames("kenneth", List.of("ken", "kenny"));
        b.nicknames("stephen", List.of("steve"));
        b.nicknames("edward", List.of("ed", "eddie", "ted", "teddy"));
        b.nicknames("ronald", List.of("ron", "ronnie"));
        b.nicknames("timothy", List.of("tim", "timmy"));
        b.nicknames("joshua", List.of("josh"));
        b.nicknames("susan", List.of("sue", "susie"));
        b.nicknames("margaret", List.of("maggie", "peggy", "meg"));
        b.nicknames("katherine", List.of("kathy", "katie", "kate"));
        b.nicknames("catherine", List.of("cathy", "catie", "cate"));
        b.nicknames("patricia", List.of("pat", "patty", "tricia"));
        b.nicknames("jennifer", List.of("jen", "jenny"));
        b.nicknames("victoria", List.of("vicky", "tori"));
        b.nicknames("rebecca", List.of("becky", "becca"));
        b.nicknames("virginia", List.of("ginny"));
        b.nicknames("theodore", List.of("theo"));
        b.nicknames("lawrence", List.of("larry"));
        b.nicknames("nicholas", List.of("nick"));
        b.nicknames("samuel", List.of("sam", "sammy"));
        b.nicknames("benjamin", List.of("ben", "benny"));
        b.nicknames("gregory", List.of("greg"));
        b.nicknames("alexander", List.of("alex", "al"));
        b.nicknames("deborah", List.of("deb", "debbie"));
        b.nicknames("barbara", List.of("barb", "barbie"));
        b.nicknames("judith", List.of("judy"));
        b.nicknames("kimberly", List.of("kim"));
        b.nicknames("pamela", List.of("pam"));
        b.nicknames("cynthia", List.of("cindy"));
        b.nicknames("sandra", List.of("sandy"));
        b.nicknames("christine", List.of("chrissy"));
        b.nicknames("janet", List.of("jan"));
        b.nicknames("carolyn", List.of("carol"));
        b.nicknames("nathan", List.of("nate"));
        b.nicknames("jonathan", List.of("jon"));
        b.nicknames("peter", List.of("pete"));
        b.nicknames("herbert", List.of("herb", "herbie"));
        b.nicknames("frederick", List.of("fred", "freddie"));
        b.nicknames("alfred", List.of("alfie"));
        b.nicknames("abraham", List.of("abe"));
        b.nicknames("leonard", List.of("len", "lenny"));
        b.nicknames("vincent", List.of("vince", "vinnie"));
        b.nicknames("philip", List.of("phil"));
        b.nicknames("francis", List.of("frank", "frankie"));
        b.nicknames("walter", List.of("walt", "wally"));
        b.nicknames("douglas", List.of("doug"));
        b.nicknames("gerald", List.of("jerry"));
        b.nicknames("ghislaine", List.of("ghislane"));
    }
}
