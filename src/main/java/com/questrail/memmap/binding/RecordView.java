package com.questrail.memmap.binding;

import com.questrail.memmap.layout.ResolvedNode;
import com.questrail.memmap.layout.ResolvedRecord;
import com.questrail.memmap.store.BackingStore;

import java.util.List;

final class RecordView extends AbstractView implements BoundRecord
{
    private final ResolvedRecord node;

    RecordView(ResolvedRecord template, int delta, BackingStore store, byte pad, String path)
    {
        super(template, delta, store, pad, path);
        this.node = template;
    }

    @Override
    public BoundElement field(String name)
    {
        ResolvedNode child = node.children().get(name);
        if (child == null) {
            throw new TypeMismatchException(describe() + " has no field '" + name + "'");
        }
        return (BoundElement) AbstractView.of(child, delta, store, pad, path() + "." + name);
    }

    @Override
    public boolean has(String name)
    {
        return node.children().containsKey(name);
    }

    @Override
    public List<String> fieldNames()
    {
        return List.copyOf(node.children().keySet());
    }

    @Override
    public BoundPrimitive primitive(String name)
    {
        return Bindings.as(field(name), BoundPrimitive.class);
    }

    @Override
    public BoundBitfield bitfield(String name)
    {
        return Bindings.as(field(name), BoundBitfield.class);
    }

    @Override
    public BoundRecord record(String name)
    {
        return Bindings.as(field(name), BoundRecord.class);
    }

    @Override
    public BoundArray array(String name)
    {
        return Bindings.as(field(name), BoundArray.class);
    }

    @Override
    public BoundElement at(String path)
    {
        return PathNavigator.navigate(this, path);
    }
}
