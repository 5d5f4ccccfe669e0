package org.oldskooler.pgschema4j.models;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.oldskooler.pgschema4j.annotations.Pg;

@Data
@NoArgsConstructor
public class Place {
    @Pg("type=int,primary")
    private int id;
    @Pg("type=text")
    private Location location;
    @Pg("type=varchar(64),nullable")
    private String label;
}
