package org.oldskooler.pgschema4j.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.oldskooler.pgschema4j.annotations.Pg;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class Tag {
    @Pg("type=int,primary,identity")
    private int id;
    @Pg("type=text,unique,conflict=DO NOTHING")
    private String label;
    @Pg("type=text,index")
    private String color;
}
