package com.blockmorph.morph;

public record Match(int sourceIndex, int targetIndex, double cost) {
}
