package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.LocationKey;
import info.isaksson.erland.gmlindex.syntax.EnumDeclarationNode;
import info.isaksson.erland.gmlindex.syntax.EnumMemberNode;
import info.isaksson.erland.gmlindex.syntax.GmlNode;
import info.isaksson.erland.gmlindex.syntax.GmlTreeWalker;

import java.util.HashMap;
import java.util.Map;

/** Enum and enum-member declarations of one file, keyed by the location key of their name. */
final class EnumLookup {

    static final class EnumInfo {
        final String key;
        final String name;

        EnumInfo(String key, String name) {
            this.key = key;
            this.name = name;
        }
    }

    static final class MemberInfo {
        final String key;
        final String name;
        final String enumKey;

        MemberInfo(String key, String name, String enumKey) {
            this.key = key;
            this.name = name;
            this.enumKey = enumKey;
        }
    }

    private final Map<String, EnumInfo> enums = new HashMap<>();
    private final Map<String, MemberInfo> members = new HashMap<>();

    static EnumLookup build(GmlNode root, String filePath) {
        EnumLookup lookup = new EnumLookup();
        GmlTreeWalker.walk(root, node -> {
            if (!(node instanceof EnumDeclarationNode)) return;
            EnumDeclarationNode decl = (EnumDeclarationNode) node;
            LocationKey enumKey = LocationKey.of(filePath, decl.name.start);
            if (enumKey == null) return;
            lookup.enums.put(enumKey.asString(), new EnumInfo(enumKey.asString(), decl.name.name));
            for (EnumMemberNode member : decl.members) {
                LocationKey memberKey = LocationKey.of(filePath, member.name.start);
                if (memberKey == null) continue;
                lookup.members.put(memberKey.asString(), new MemberInfo(memberKey.asString(), member.name.name, enumKey.asString()));
            }
        });
        return lookup;
    }

    EnumInfo enumAt(String key) {
        return key == null ? null : enums.get(key);
    }

    MemberInfo memberAt(String key) {
        return key == null ? null : members.get(key);
    }
}
