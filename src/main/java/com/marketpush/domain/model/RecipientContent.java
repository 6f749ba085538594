package com.marketpush.domain.model;

import lombok.Value;

/** Authoritative settings and the available content for one recipient. */
@Value
public class RecipientContent {

    PushSettings settings;
    ContentBatch batch;
}
