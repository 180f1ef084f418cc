package com.example.runbookops.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Global setting such as routing rules or a team credential.
 */
@Entity
@Table(name = "settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingEntry {

    @Id
    @Column(name = "setting_key")
    private String key;

    @Column(name = "setting_value", length = 16000)
    private String value;
}
