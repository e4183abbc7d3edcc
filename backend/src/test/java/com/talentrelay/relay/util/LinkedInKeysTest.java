package com.talentrelay.relay.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinkedInKeysTest {

    @Test
    void urlVariantsCollapseToOneKey() {
        List<String> variants = List.of(
            "https://www.linkedin.com/in/jane-doe/",
            "http://linkedin.com/in/jane-doe",
            "HTTPS://WWW.LINKEDIN.COM/in/Jane-Doe?trk=public_profile",
            "linkedin.com/in/jane-doe#about",
            "//www.linkedin.com/in/jane-doe///"
        );
        for (String variant : variants) {
            assertThat(LinkedInKeys.normalize(variant)).as(variant).isEqualTo("linkedin.com/in/jane-doe");
        }
    }

    @Test
    void nonLinkedInLinksAreNotKeys() {
        assertThat(LinkedInKeys.normalize("https://github.com/jane-doe")).isNull();
        assertThat(LinkedInKeys.normalize("   ")).isNull();
        assertThat(LinkedInKeys.normalize(null)).isNull();
    }

    @Test
    void handlesBecomeProfileKeys() {
        assertThat(LinkedInKeys.fromHandle("jane-doe")).isEqualTo("linkedin.com/in/jane-doe");
        assertThat(LinkedInKeys.fromHandle("@Jane-Doe/")).isEqualTo("linkedin.com/in/jane-doe");
        assertThat(LinkedInKeys.fromHandle("https://www.linkedin.com/in/jane-doe/")).isEqualTo("linkedin.com/in/jane-doe");
        assertThat(LinkedInKeys.fromHandle("not a handle")).isNull();
        assertThat(LinkedInKeys.fromHandle("")).isNull();
    }

    @Test
    void keysOfSkipsNonLinkedInAndDeduplicates() {
        assertThat(LinkedInKeys.keysOf(List.of(
            "https://linkedin.com/in/jane-doe",
            "https://www.linkedin.com/in/jane-doe/",
            "https://twitter.com/jane"
        ))).containsExactly("linkedin.com/in/jane-doe");
    }
}
