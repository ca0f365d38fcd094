package com.xbleey.grafanareporter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RenderOptions {

    private int width;
    private int height;
    private int scale;
}
