package com.example.letters.domain.render;

import com.example.letters.domain.model.DocumentProperties;
import com.example.letters.domain.model.PageSize;

/**
 * Opens a fresh {@link DrawingSurface} for every render call.
 */
public interface DrawingSurfaceFactory {

    DrawingSurface open(PageSize pageSize, DocumentProperties properties);
}
