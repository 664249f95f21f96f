package com.autobulk.convert;

import com.autobulk.RecipientSource;
import jakarta.persistence.Converter;

@Converter
public class RecipientSourceConverter extends StoredEnumConverter<RecipientSource> {

    public RecipientSourceConverter() {
        super(RecipientSource.class);
    }
}
