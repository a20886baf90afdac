package com.apogee.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One fact/analogy pair of a script, stored inside the {@code scripts.beats} jsonb array. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScriptBeat {
    private String fact;
    private String analogy;
}
