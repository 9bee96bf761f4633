package com.gridt.admin.application.port.out;

/**
 * Source of random text for fixtures. Implementations make no promise about length;
 * callers fit the values to their columns.
 */
public interface TextSource {

    String sentence();

    String paragraph();

    /**
     * A paragraph of roughly {@code sentences} sentences.
     */
    String paragraph(int sentences);

    String username();

    String emailDomain();

    String password();
}
