package com.gridt.admin.adapter.out.fixture;

import com.gridt.admin.application.port.out.TextSource;
import com.gridt.admin.infrastructure.config.AdminProperties;
import net.datafaker.Faker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Random;

/**
 * Lorem ipsum and plausible user data from Datafaker.
 */
@Component
public class DatafakerTextSource implements TextSource {

    private final Faker faker;

    @Autowired
    public DatafakerTextSource(AdminProperties properties, Random random) {
        this(new Faker(Locale.forLanguageTag(properties.getFixtures().getLocale()), random));
    }

    DatafakerTextSource(Faker faker) {
        this.faker = faker;
    }

    @Override
    public String sentence() {
        return faker.lorem().sentence();
    }

    @Override
    public String paragraph() {
        return faker.lorem().paragraph();
    }

    @Override
    public String paragraph(int sentences) {
        return faker.lorem().paragraph(sentences);
    }

    @Override
    public String username() {
        return faker.name().username();
    }

    @Override
    public String emailDomain() {
        return faker.internet().domainName();
    }

    @Override
    public String password() {
        return faker.internet().password(10, 24);
    }
}
